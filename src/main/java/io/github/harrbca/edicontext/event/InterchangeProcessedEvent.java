package io.github.harrbca.edicontext.event;

import io.github.harrbca.edicontext.service.InterchangeSummary;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

@Getter
public class InterchangeProcessedEvent extends ApplicationEvent {

    private final String fileName;
    private final boolean success;
    private final InterchangeSummary summary;

    public InterchangeProcessedEvent(Object source, String fileName, boolean success, InterchangeSummary summary) {
        super(source);
        this.fileName = fileName;
        this.success = success;
        this.summary = summary;
    }
}
