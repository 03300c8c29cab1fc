package com.park.lot.kafka;

import com.park.common.model.ParkingEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Used when Kafka publishing is switched off; events only go to the application log. */
@Slf4j
@Component
@ConditionalOnProperty(name = "parking.events.kafka-enabled", havingValue = "false", matchIfMissing = true)
public class LoggingParkingEventPublisher implements ParkingEventPublisher {

    @Override
    public void publish(ParkingEvent event) {
        log.info("Parking event (kafka disabled): {}", event);
    }
}
