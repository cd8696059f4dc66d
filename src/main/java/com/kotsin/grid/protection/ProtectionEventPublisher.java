package com.kotsin.grid.protection;

public interface ProtectionEventPublisher {

    void publish(ProtectionEvent event);
}
