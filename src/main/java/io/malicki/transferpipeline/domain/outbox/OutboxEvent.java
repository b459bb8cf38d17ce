package io.malicki.transferpipeline.domain.outbox;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * A lifecycle event waiting to be shipped to Kafka. Written in the same
 * transaction as the transfer change it describes.
 */
@Entity
@Table(
    name = "outbox_events",
    indexes = {
        @Index(name = "idx_outbox_unpublished", columnList = "processed, retryCount, createdAt"),
        @Index(name = "idx_outbox_aggregate", columnList = "aggregateId")
    }
)
@Getter
@Setter
@NoArgsConstructor
public class OutboxEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 36, updatable = false)
    private String aggregateId;

    @Column(nullable = false, length = 50, updatable = false)
    private String eventType;

    @Column(nullable = false, updatable = false)
    private String destinationTopic;

    // Owner's user id, so one user's lifecycle stays on one partition
    @Column(nullable = false, length = 36, updatable = false)
    private String routingKey;

    @Column(nullable = false, columnDefinition = "TEXT", updatable = false)
    private String payload;

    @Column(nullable = false)
    private boolean processed = false;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    private Instant processedAt;

    @Column(nullable = false)
    private int retryCount = 0;

    @Column(length = 500)
    private String lastError;

    public OutboxEvent(String aggregateId, String eventType, String destinationTopic,
                       String routingKey, String payload) {
        this.aggregateId = aggregateId;
        this.eventType = eventType;
        this.destinationTopic = destinationTopic;
        this.routingKey = routingKey;
        this.payload = payload;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public void markPublished() {
        this.processed = true;
        this.processedAt = Instant.now();
        this.lastError = null;
    }

    public void recordFailure(String error) {
        this.retryCount++;
        this.lastError = error != null && error.length() > 500 ? error.substring(0, 500) : error;
    }
}
