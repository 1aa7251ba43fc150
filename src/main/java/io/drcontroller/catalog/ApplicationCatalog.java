package io.drcontroller.catalog;

import io.drcontroller.models.Application;

import java.util.List;
import java.util.Optional;

/**
 * The applications under DR control, loaded once and immutable afterwards.
 */
public interface ApplicationCatalog {

    List<Application> getApplications();

    Optional<Application> findApplication(String name);

    default Application getApplication(String name) {
        return findApplication(name).orElseThrow(() -> new ApplicationNotFoundException(name));
    }
}
