package com.pmsuite.orchestrator.collaboration;

import java.util.List;
import java.util.Optional;

/**
 * Labs and researchers as read from the Labs backend for one request.
 */
public record LabsSnapshot(List<Lab> labs, List<Researcher> researchers) {

    public LabsSnapshot {
        labs = List.copyOf(labs);
        researchers = List.copyOf(researchers);
    }

    public Optional<Lab> findLab(String labId) {
        return labs.stream().filter(lab -> lab.id().equals(labId)).findFirst();
    }

    public List<Researcher> researchersOf(String labId) {
        return researchers.stream().filter(researcher -> labId.equals(researcher.labId())).toList();
    }
}
