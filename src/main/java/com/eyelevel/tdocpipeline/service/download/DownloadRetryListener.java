package com.eyelevel.tdocpipeline.service.download;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Component("downloadRetryListener")
@Slf4j
public class DownloadRetryListener implements RetryListener {
    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
        log.warn("Archive download failed on attempt {}: {}. Retrying if attempts remain.",
                context.getRetryCount(), throwable.getMessage());
    }
}
