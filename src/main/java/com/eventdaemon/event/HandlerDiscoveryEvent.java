package com.eventdaemon.event;

import org.springframework.context.ApplicationEvent;

/** Published at the end of every handler discovery pass. */
public class HandlerDiscoveryEvent extends ApplicationEvent {

    private final int loadedFiles;
    private final int failedFiles;
    private final int registrations;

    public HandlerDiscoveryEvent(Object source, int loadedFiles, int failedFiles, int registrations) {
        super(source);
        this.loadedFiles = loadedFiles;
        this.failedFiles = failedFiles;
        this.registrations = registrations;
    }

    public int getLoadedFiles() {
        return loadedFiles;
    }

    public int getFailedFiles() {
        return failedFiles;
    }

    public int getRegistrations() {
        return registrations;
    }
}
