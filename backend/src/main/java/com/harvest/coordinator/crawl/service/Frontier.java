package com.harvest.coordinator.crawl.service;

import com.harvest.coordinator.crawl.model.FrontierEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Work queue of one job. Every URI is accepted once; pages and documents are queued separately so
 * documents can be downloaded in their own substate.
 */
public class Frontier {
    private final Deque<FrontierEntry> pending = new ArrayDeque<>();
    private final Deque<FrontierEntry> pendingDocuments = new ArrayDeque<>();
    private final Map<String, FrontierEntry> inFlight = new LinkedHashMap<>();
    private final Set<String> completed = new LinkedHashSet<>();
    private final Set<String> failed = new LinkedHashSet<>();
    private final Set<String> seen = new HashSet<>();

    public record Snapshot(
        List<FrontierEntry> pending,
        List<FrontierEntry> pendingDocuments,
        List<String> completed,
        List<String> failed
    ) {
    }

    /** @return {@code false} if the URI was already known */
    public synchronized boolean offer(FrontierEntry entry) {
        if (entry == null || entry.uri() == null || !seen.add(entry.uri())) {
            return false;
        }
        if (entry.document()) {
            pendingDocuments.addLast(entry);
        } else {
            pending.addLast(entry);
        }
        return true;
    }

    public synchronized Optional<FrontierEntry> poll(boolean documents) {
        FrontierEntry next = documents ? pendingDocuments.pollFirst() : pending.pollFirst();
        if (next == null) {
            return Optional.empty();
        }
        inFlight.put(next.uri(), next);
        return Optional.of(next);
    }

    public synchronized void complete(String uri) {
        inFlight.remove(uri);
        completed.add(uri);
    }

    public synchronized void fail(String uri) {
        inFlight.remove(uri);
        failed.add(uri);
    }

    /** Puts an in-flight URI back at the head of its queue. */
    public synchronized void requeue(String uri) {
        FrontierEntry entry = inFlight.remove(uri);
        if (entry == null) {
            return;
        }
        if (entry.document()) {
            pendingDocuments.addFirst(entry);
        } else {
            pending.addFirst(entry);
        }
    }

    public synchronized boolean hasPending(boolean documents) {
        return documents ? !pendingDocuments.isEmpty() : !pending.isEmpty();
    }

    public synchronized int inFlightCount() {
        return inFlight.size();
    }

    public synchronized int pendingCount() {
        return pending.size() + pendingDocuments.size();
    }

    public synchronized int completedCount() {
        return completed.size();
    }

    public synchronized int knownCount() {
        return seen.size();
    }

    public synchronized boolean isCompleted(String uri) {
        return completed.contains(uri);
    }

    /** In-flight work is reported as pending, pages ahead of queued ones. */
    public synchronized Snapshot snapshot() {
        List<FrontierEntry> pages = new ArrayList<>();
        List<FrontierEntry> documents = new ArrayList<>();
        for (FrontierEntry entry : inFlight.values()) {
            (entry.document() ? documents : pages).add(entry);
        }
        pages.addAll(pending);
        documents.addAll(pendingDocuments);
        return new Snapshot(pages, documents, List.copyOf(completed), List.copyOf(failed));
    }

    public synchronized void restore(
        List<FrontierEntry> pendingPages,
        List<FrontierEntry> documents,
        List<String> completedUris,
        List<String> failedUris
    ) {
        pending.clear();
        pendingDocuments.clear();
        inFlight.clear();
        completed.clear();
        failed.clear();
        seen.clear();
        completed.addAll(completedUris);
        failed.addAll(failedUris);
        seen.addAll(completedUris);
        seen.addAll(failedUris);
        for (FrontierEntry entry : pendingPages) {
            offer(entry);
        }
        for (FrontierEntry entry : documents) {
            offer(entry);
        }
    }
}
