package com.example.presence.shared.config;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.util.backoff.BackOff;

/**
 * Logs one structured line per failed record instead of a stack trace per retry,
 * then hands over to the default retry and DLT handling.
 */
public class ConciseLoggingErrorHandler extends DefaultErrorHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConciseLoggingErrorHandler.class);

    public ConciseLoggingErrorHandler(DeadLetterPublishingRecoverer deadLetterPublishingRecoverer, BackOff backOff) {
        super(deadLetterPublishingRecoverer, backOff);
    }

    @Override
    public boolean handleOne(Exception thrownException, ConsumerRecord<?, ?> record, Consumer<?, ?> consumer, MessageListenerContainer container) {
        log(record, thrownException);
        return super.handleOne(thrownException, record, consumer, container);
    }

    private void log(ConsumerRecord<?, ?> record, Exception exception) {
        Throwable cause = exception.getCause() != null ? exception.getCause() : exception;
        LOGGER.error(
            "Failed to apply presence event. topic={}, partition={}, offset={}, key={}, type={}, message='{}'",
            record.topic(),
            record.partition(),
            record.offset(),
            record.key(),
            cause.getClass().getSimpleName(),
            cause.getMessage()
        );

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Full stack trace for failed record:", exception);
        }
    }
}
