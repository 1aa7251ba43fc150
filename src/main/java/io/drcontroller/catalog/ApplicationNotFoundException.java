package io.drcontroller.catalog;

import lombok.Getter;

@Getter
public class ApplicationNotFoundException extends RuntimeException {

    private final String applicationName;

    public ApplicationNotFoundException(String applicationName) {
        super("Application '" + applicationName + "' not found");
        this.applicationName = applicationName;
    }
}
