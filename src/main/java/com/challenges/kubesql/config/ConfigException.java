package com.challenges.kubesql.config;

import com.challenges.kubesql.KubeSqlException;

/**
 * The kubeconfig could not be located, read or parsed.
 */
public class ConfigException extends KubeSqlException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
