package com.nudge.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nudge.exception.NudgeException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads entity snapshots from JSON arrays.
 * Applicants use camelCase keys, leads use the snake_case column names of the
 * lead table. Unrecognized keys are kept as attributes so date fields stay reachable.
 */
public class EntityReader {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final TypeReference<List<Map<String, Object>>> RECORDS = new TypeReference<>() {
    };

    private static final Set<String> APPLICANT_KEYS = Set.of(
            "id", "firstName", "lastName", "phaseOverride", "calculatedPhase",
            "phaseTimestamps", "tasks", "notes", "applicationDate", "archived");

    private static final Set<String> LEAD_KEYS = Set.of(
            "id", "first_name", "last_name", "phase", "phase_timestamps",
            "tasks", "notes", "created_at", "archived");

    public List<Applicant> readApplicants(String json) {
        return toApplicants(parse(json));
    }

    public List<Applicant> readApplicants(InputStream in) {
        return toApplicants(parse(in));
    }

    public List<Lead> readLeads(String json) {
        return toLeads(parse(json));
    }

    public List<Lead> readLeads(InputStream in) {
        return toLeads(parse(in));
    }

    private List<Applicant> toApplicants(List<Map<String, Object>> records) {
        List<Applicant> applicants = new ArrayList<>();
        for (Map<String, Object> map : records) {
            if (map == null) {
                continue;
            }
            applicants.add(Applicant.builder()
                    .id(asString(map.get("id")))
                    .name(asString(map.get("firstName")), asString(map.get("lastName")))
                    .phaseOverride(asString(map.get("phaseOverride")))
                    .calculatedPhase(asString(map.get("calculatedPhase")))
                    .phaseTimestamps(asTimestamps(map.get("phaseTimestamps")))
                    .tasks(asMap(map.get("tasks")))
                    .notes(asNotes(map.get("notes")))
                    .applicationDate(map.get("applicationDate"))
                    .archived(Boolean.TRUE.equals(map.get("archived")))
                    .attributes(remaining(map, APPLICANT_KEYS))
                    .build());
        }
        return applicants;
    }

    private List<Lead> toLeads(List<Map<String, Object>> records) {
        List<Lead> leads = new ArrayList<>();
        for (Map<String, Object> map : records) {
            if (map == null) {
                continue;
            }
            leads.add(Lead.builder()
                    .id(asString(map.get("id")))
                    .name(asString(map.get("first_name")), asString(map.get("last_name")))
                    .phase(asString(map.get("phase")))
                    .phaseTimestamps(asTimestamps(map.get("phase_timestamps")))
                    .tasks(asMap(map.get("tasks")))
                    .notes(asNotes(map.get("notes")))
                    .createdAt(map.get("created_at"))
                    .archived(Boolean.TRUE.equals(map.get("archived")))
                    .attributes(remaining(map, LEAD_KEYS))
                    .build());
        }
        return leads;
    }

    private List<Map<String, Object>> parse(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, RECORDS);
        } catch (JsonProcessingException e) {
            throw new NudgeException("Failed to parse entity JSON: " + e.getOriginalMessage(), e);
        }
    }

    private List<Map<String, Object>> parse(InputStream in) {
        if (in == null) {
            throw new NudgeException("Entity JSON stream is null; is the resource on the classpath?");
        }
        try {
            return objectMapper.readValue(in, RECORDS);
        } catch (IOException e) {
            throw new NudgeException("Failed to read entity JSON", e);
        }
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : Map.of();
    }

    private static Map<String, Long> asTimestamps(Object value) {
        Map<String, Long> timestamps = new HashMap<>();
        asMap(value).forEach((phase, ts) -> {
            if (ts instanceof Number n) {
                timestamps.put(phase, n.longValue());
            }
        });
        return timestamps;
    }

    private static List<Note> asNotes(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<Note> notes = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof Map<?, ?> map) {
                notes.add(new Note(asString(map.get("text")), map.get("timestamp"), map.get("date")));
            } else if (item instanceof String text) {
                // plain-text notes carry no date
                notes.add(new Note(text, null, null));
            }
        }
        return notes;
    }

    private static Map<String, Object> remaining(Map<String, Object> map, Set<String> known) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        map.forEach((key, value) -> {
            if (!known.contains(key) && value != null) {
                attributes.put(key, value);
            }
        });
        return attributes;
    }
}
