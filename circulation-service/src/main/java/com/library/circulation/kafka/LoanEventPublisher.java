package com.library.circulation.kafka;

import com.library.circulation.dto.LoanEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

@Component
@RequiredArgsConstructor
@Slf4j
public class LoanEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${kafka.topics.loan-created:loan.created}")
    private String loanCreatedTopic;

    @Value("${kafka.topics.loan-returned:loan.returned}")
    private String loanReturnedTopic;

    /**
     * Sends the event once the surrounding transaction commits, or immediately when there is none.
     * A rolled-back borrow or return therefore never produces an event.
     */
    public void publishAfterCommit(LoanEvent event) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    send(event);
                }
            });
        } else {
            send(event);
        }
    }

    private void send(LoanEvent event) {
        String topic = event.type() == LoanEvent.Type.LOAN_CREATED ? loanCreatedTopic : loanReturnedTopic;
        try {
            kafkaTemplate.send(topic, event.loanId().toString(), event)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to publish {} event for loanId={}", topic, event.loanId(), ex);
                    } else {
                        log.info("Published {} event: loanId={} offset={}",
                            topic,
                            event.loanId(),
                            result.getRecordMetadata().offset());
                    }
                });
        } catch (RuntimeException ex) {
            // send() can fail synchronously (metadata timeout, serialization); the loan outcome stands
            log.error("Failed to publish {} event for loanId={}", topic, event.loanId(), ex);
        }
    }
}
