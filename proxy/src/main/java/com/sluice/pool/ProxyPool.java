package com.sluice.pool;

import com.sluice.model.ProxyClassification;
import com.sluice.model.ProxyEndpoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class ProxyPool {

    private final Map<ProxyEndpoint, ProxyRecord> records = new ConcurrentHashMap<>();
    private final List<ProxyRecord> ordered = new CopyOnWriteArrayList<>();
    private final boolean selectUntested;
    // rebuilt whole on every change, under the state machine's lock
    private volatile PoolView view = PoolView.EMPTY;

    public ProxyPool(boolean selectUntested) {
        this.selectUntested = selectUntested;
    }

    public Optional<ProxyRecord> get(ProxyEndpoint endpoint) {
        return Optional.ofNullable(records.get(endpoint));
    }

    public List<ProxyRecord> getAll() {
        return List.copyOf(ordered);
    }

    public List<ProxyRecord> getWorking() {
        return view.working();
    }

    public List<ProxyRecord> getFailed() {
        return view.failed();
    }

    public List<ProxyRecord> getUntested() {
        return view.untested();
    }

    public List<ProxyRecord> getSelectable() {
        return view.selectable();
    }

    public PoolView view() {
        return view;
    }

    public int size() {
        return ordered.size();
    }

    public boolean isEmpty() {
        return ordered.isEmpty();
    }

    ProxyRecord add(ProxyEndpoint endpoint) {
        if (records.containsKey(endpoint)) {
            return null;
        }
        ProxyRecord record = new ProxyRecord(endpoint);
        records.put(endpoint, record);
        ordered.add(record);
        rebuildView();
        return record;
    }

    void reclassify(ProxyRecord record, ProxyClassification classification) {
        ProxyClassification previous = record.getClassification();
        record.transitionTo(classification);
        if (previous != classification) {
            rebuildView();
        }
    }

    private void rebuildView() {
        List<ProxyRecord> working = new ArrayList<>();
        List<ProxyRecord> failed = new ArrayList<>();
        List<ProxyRecord> untested = new ArrayList<>();
        List<ProxyRecord> selectable = new ArrayList<>();

        for (ProxyRecord record : ordered) {
            switch (record.getClassification()) {
                case WORKING -> {
                    working.add(record);
                    selectable.add(record);
                }
                case FAILED -> failed.add(record);
                case UNTESTED -> {
                    untested.add(record);
                    if (selectUntested) {
                        selectable.add(record);
                    }
                }
            }
        }

        view = new PoolView(List.copyOf(working), List.copyOf(failed),
                List.copyOf(untested), List.copyOf(selectable));
    }

    public record PoolView(List<ProxyRecord> working,
                           List<ProxyRecord> failed,
                           List<ProxyRecord> untested,
                           List<ProxyRecord> selectable) {

        static final PoolView EMPTY = new PoolView(List.of(), List.of(), List.of(), List.of());
    }
}
