package com.example.mediagen_backend.service.scheduler;

import com.example.mediagen_backend.model.Job;
import com.example.mediagen_backend.util.JobType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

public class InMemoryJobHistoryStore implements JobHistoryStore {

    private final int capacity;
    private final Deque<Entry> entries = new ArrayDeque<>();

    public InMemoryJobHistoryStore(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    @Override
    public synchronized void record(Job job) {
        entries.addFirst(Entry.from(job));
        while (entries.size() > capacity) {
            entries.removeLast();
        }
    }

    @Override
    public synchronized List<Entry> recent(JobType type, int limit) {
        List<Entry> out = new ArrayList<>();
        Iterator<Entry> it = entries.iterator();
        while (it.hasNext() && out.size() < limit) {
            Entry entry = it.next();
            if (type == null || entry.type() == type) {
                out.add(entry);
            }
        }
        return out;
    }
}
