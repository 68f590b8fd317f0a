package com.certledger;

import com.certledger.models.Evaluation;
import com.certledger.storage.JsonStorage;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only record of every classification. Re-evaluating a contribution
 * adds a record; earlier ones are never rewritten.
 */
public class EvaluationLog {

    private final Map<String, List<Evaluation>> byContribution = new ConcurrentHashMap<>();
    private final Path storagePath;

    public EvaluationLog(Path storagePath) {
        this.storagePath = storagePath;
        loadFromDisk();
    }

    public Evaluation record(Evaluation evaluation) {
        if (evaluation == null || evaluation.getContributionId() == null) {
            throw new IllegalArgumentException("Evaluation with a contributionId is required");
        }
        Evaluation stored = evaluation.copy();
        byContribution.computeIfAbsent(stored.getContributionId(), key -> new CopyOnWriteArrayList<>()).add(stored);
        saveAll();
        return stored.copy();
    }

    public List<Evaluation> history(String contributionId) {
        List<Evaluation> results = new ArrayList<>();
        List<Evaluation> stored = contributionId != null ? byContribution.get(contributionId) : null;
        if (stored == null) {
            return results;
        }
        for (Evaluation evaluation : stored) {
            results.add(evaluation.copy());
        }
        return results;
    }

    public Evaluation latest(String contributionId) {
        List<Evaluation> history = history(contributionId);
        return history.isEmpty() ? null : history.get(history.size() - 1);
    }

    public int count() {
        int total = 0;
        for (List<Evaluation> evaluations : byContribution.values()) {
            total += evaluations.size();
        }
        return total;
    }

    private void loadFromDisk() {
        if (storagePath == null) {
            return;
        }
        try {
            List<Evaluation> stored = new ArrayList<>(JsonStorage.readJsonList(storagePath, Evaluation[].class));
            stored.sort(Comparator.comparingLong(Evaluation::getEvaluatedAt));
            for (Evaluation evaluation : stored) {
                if (evaluation != null && evaluation.getContributionId() != null) {
                    byContribution.computeIfAbsent(evaluation.getContributionId(), key -> new CopyOnWriteArrayList<>())
                        .add(evaluation);
                }
            }
            log("Loaded " + stored.size() + " evaluation(s) from disk.");
        } catch (Exception e) {
            logWarning("Failed to load evaluations from " + storagePath + ": " + e.getMessage());
        }
    }

    private synchronized void saveAll() {
        if (storagePath == null) {
            return;
        }
        List<Evaluation> data = new ArrayList<>();
        for (List<Evaluation> evaluations : byContribution.values()) {
            data.addAll(evaluations);
        }
        data.sort(Comparator.comparingLong(Evaluation::getEvaluatedAt));
        try {
            JsonStorage.writeJsonList(storagePath, data);
        } catch (Exception e) {
            logWarning("Failed to save evaluations to " + storagePath + ": " + e.getMessage());
        }
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[EvaluationLog] " + message);
        }
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[EvaluationLog] " + message);
        }
    }
}
