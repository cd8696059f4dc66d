package com.kotsin.grid.engine;

import com.kotsin.grid.model.OpenOrder;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Resting quantity per {@link OrderRole}. Never negative. Not thread-safe;
 * guarded by the engine lock.
 */
public class PendingOrderCounters {

    private final EnumMap<OrderRole, Double> quantities = new EnumMap<>(OrderRole.class);

    public PendingOrderCounters() {
        clear();
    }

    public double get(OrderRole role) {
        return quantities.get(role);
    }

    public void add(OrderRole role, double qty) {
        quantities.put(role, Math.max(0.0, get(role) + qty));
    }

    public void subtract(OrderRole role, double qty) {
        quantities.put(role, Math.max(0.0, get(role) - qty));
    }

    public void clear() {
        for (OrderRole role : OrderRole.values()) quantities.put(role, 0.0);
    }

    /** Overwrites every counter with the totals of the given snapshot. */
    public void replaceWith(Collection<OpenOrder> openOrders) {
        clear();
        for (OpenOrder o : openOrders) {
            OrderRole role = OrderRole.classify(o.getSide(), o.getPositionSide(), o.isReduceOnly());
            if (role != null) add(role, o.getOrigQty());
        }
    }

    public Map<OrderRole, Double> asMap() {
        return Collections.unmodifiableMap(new EnumMap<>(quantities));
    }
}
