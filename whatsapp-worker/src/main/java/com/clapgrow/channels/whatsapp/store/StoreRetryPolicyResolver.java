package com.clapgrow.channels.whatsapp.store;

import com.clapgrow.channels.common.retry.FailureClassification;
import com.clapgrow.channels.common.retry.RetryPolicy;
import com.clapgrow.channels.common.retry.RetryPolicyResolver;
import com.clapgrow.channels.whatsapp.config.WorkerProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class StoreRetryPolicyResolver implements RetryPolicyResolver {

    private final RetryPolicy transientPolicy;

    @Autowired
    public StoreRetryPolicyResolver(WorkerProperties properties) {
        this(properties.getPublisher().toRetryPolicy());
    }

    public StoreRetryPolicyResolver(RetryPolicy transientPolicy) {
        this.transientPolicy = transientPolicy;
    }

    @Override
    public RetryPolicy resolve(FailureClassification classification) {
        return switch (classification) {
            case PERMANENT -> RetryPolicy.noRetry();
            case RATE_LIMIT, TRANSIENT -> transientPolicy;
        };
    }
}
