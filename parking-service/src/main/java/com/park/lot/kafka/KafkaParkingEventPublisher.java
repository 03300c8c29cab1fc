package com.park.lot.kafka;

import com.park.common.model.ParkingEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "parking.events.kafka-enabled", havingValue = "true")
public class KafkaParkingEventPublisher implements ParkingEventPublisher {

    private final KafkaTemplate<String, ParkingEvent> parkingEventKafkaTemplate;

    @Value("${parking.events.topic:parking.lot.event}")
    private String topic;

    @Override
    public void publish(ParkingEvent event) {
        try {
            parkingEventKafkaTemplate.send(topic, event.getPlateNumber(), event)
                    .whenComplete((result, ex) -> {
                        if (ex == null) {
                            log.info("Published {} event for {} eventId={} to topic={}",
                                    event.getAction(), event.getPlateNumber(), event.getEventId(), topic);
                        } else {
                            log.error("Failed to publish eventId={} for {}: {}",
                                    event.getEventId(), event.getPlateNumber(), ex.getMessage());
                        }
                    });
        } catch (RuntimeException e) {
            log.error("Kafka send failed for eventId={} plate={}: {}",
                    event.getEventId(), event.getPlateNumber(), e.getMessage());
        }
    }
}
