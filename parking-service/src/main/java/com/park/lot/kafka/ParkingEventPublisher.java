package com.park.lot.kafka;

import com.park.common.model.ParkingEvent;

/**
 * Outlet for committed entry/exit events. Implementations must not throw:
 * the operation they report on has already been committed.
 */
public interface ParkingEventPublisher {

    void publish(ParkingEvent event);

}
