package com.eyelevel.invoiceprocessor.service.analysis.textract;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Component("analysisRetryListener")
@Slf4j
public class AnalysisRetryListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        String storageKey = "unknown";
        Object[] args = (Object[]) context.getAttribute("context.args");
        if (args != null && args.length > 0 && args[0] instanceof String) {
            storageKey = (String) args[0];
        }
        log.warn("Analysis job start for '{}' failed on attempt {}: {}", storageKey, context.getRetryCount(),
                 throwable.getMessage());
    }
}
