package com.pathway.impact.fixtures;

import com.pathway.impact.aggregate.ActivityProvider;
import com.pathway.impact.core.model.ActivityRecord;
import com.pathway.impact.core.model.TargetAnnotation;
import com.pathway.impact.error.UpstreamUnavailableException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

public class FakeActivityProvider implements ActivityProvider {

    public static final String SOURCE = "chembl";

    private final Map<String, List<ActivityRecord>> activities = new HashMap<>();
    private final Map<String, TargetAnnotation> annotations = new HashMap<>();
    private volatile boolean activitiesDown;
    private volatile boolean annotationsDown;

    public FakeActivityProvider activities(String compoundId, List<ActivityRecord> records) {
        activities.put(compoundId, new ArrayList<>(records));
        return this;
    }

    public FakeActivityProvider annotate(TargetAnnotation annotation) {
        annotations.put(annotation.targetId(), annotation);
        return this;
    }

    public void setActivitiesDown(boolean activitiesDown) {
        this.activitiesDown = activitiesDown;
    }

    public void setAnnotationsDown(boolean annotationsDown) {
        this.annotationsDown = annotationsDown;
    }

    @Override
    public String sourceName() {
        return SOURCE;
    }

    @Override
    public Optional<String> sourceVersion() {
        return Optional.of("34");
    }

    @Override
    public boolean ping() {
        return !activitiesDown;
    }

    @Override
    public List<ActivityRecord> fetchActivities(String canonicalCompoundId) {
        if (activitiesDown) {
            throw new UpstreamUnavailableException(SOURCE, "503 Service Unavailable");
        }
        return activities.getOrDefault(canonicalCompoundId, List.of());
    }

    @Override
    public Map<String, TargetAnnotation> fetchTargetAnnotations(Collection<String> targetIds) {
        if (annotationsDown) {
            throw new UpstreamUnavailableException(SOURCE, "503 Service Unavailable");
        }
        Map<String, TargetAnnotation> found = new TreeMap<>();
        for (String targetId : targetIds) {
            TargetAnnotation annotation = annotations.get(targetId);
            if (annotation != null) {
                found.put(targetId, annotation);
            }
        }
        return found;
    }
}
