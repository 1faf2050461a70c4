package com.tencent.hpcflow.domain.repository;

import com.tencent.hpcflow.domain.exception.ConflictException;
import com.tencent.hpcflow.domain.exception.NotFoundException;
import com.tencent.hpcflow.domain.pipeline.Pipeline;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryPipelineRepository implements PipelineRepository {

    private final Map<String, Pipeline> store = new ConcurrentHashMap<>();

    @Override
    public synchronized void insert(Pipeline pipeline) {
        if (store.containsKey(pipeline.getName())) {
            throw new ConflictException("pipeline:" + pipeline.getName(), "Pipeline already exists");
        }
        pipeline.setRevision(0);
        store.put(pipeline.getName(), pipeline.copy());
    }

    @Override
    public synchronized void update(Pipeline pipeline) {
        Pipeline current = store.get(pipeline.getName());
        if (current == null) {
            throw new NotFoundException("pipeline:" + pipeline.getName(), "Pipeline not found");
        }
        if (!current.getRevision().equals(pipeline.getRevision())) {
            throw new ConflictException("pipeline:" + pipeline.getName(), "Pipeline was modified concurrently");
        }
        pipeline.setRevision(current.getRevision() + 1);
        store.put(pipeline.getName(), pipeline.copy());
    }

    @Override
    public Optional<Pipeline> findByName(String name) {
        return Optional.ofNullable(store.get(name)).map(Pipeline::copy);
    }

    @Override
    public List<Pipeline> findAll() {
        return store.values().stream()
                .map(Pipeline::copy)
                .sorted(Comparator.comparing(Pipeline::getName))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public boolean delete(String name) {
        return store.remove(name) != null;
    }

    @Override
    public boolean exists(String name) {
        return store.containsKey(name);
    }
}
