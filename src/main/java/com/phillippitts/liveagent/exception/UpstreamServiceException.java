package com.phillippitts.liveagent.exception;

/**
 * Thrown when an external rendering or model service misbehaves after it was connected
 * (send failure, stream ended early). Avatar rendering reacts by degrading to audio-only.
 */
public class UpstreamServiceException extends LiveAgentException {

    private final String serviceName;

    public UpstreamServiceException(String serviceName, String message) {
        super(message + " (service: " + serviceName + ")");
        this.serviceName = serviceName;
    }

    public UpstreamServiceException(String serviceName, String message, Throwable cause) {
        super(message + " (service: " + serviceName + ")", cause);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
