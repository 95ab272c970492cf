package com.edge.merger.core.error;

public class ConfigurationException extends MergeException {

    public ConfigurationException(String message) {
        super(MergeErrorCode.CONFIGURATION_ERROR, message);
    }
}
