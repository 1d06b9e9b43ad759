package com.phillippitts.liveagent.exception;

/**
 * Thrown when a session cannot be assembled because a required collaborator or parameter
 * is missing. Raised before any stream is opened and always fatal for the session.
 */
public class ConfigurationException extends LiveAgentException {

    private final String parameter;

    public ConfigurationException(String parameter, String message) {
        super(message + " (parameter: " + parameter + ")");
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
