package in.warroom.application.port.output;

import in.warroom.domain.model.Incident;

import java.util.Optional;

/**
 * Source of incidents to triage (scenario catalog, generator, ...).
 */
public interface IncidentProvider {

    /**
     * Supply the incident for the next run.
     *
     * @return the incident, or empty if none can be supplied
     */
    Optional<Incident> nextIncident();
}
