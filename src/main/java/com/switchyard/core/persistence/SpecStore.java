package com.switchyard.core.persistence;

import com.switchyard.core.model.Spec;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface SpecStore {

    void insert(Spec spec);

    Optional<Spec> findByName(Path repositoryPath, String name);

    List<Spec> list(Path repositoryPath);

    void updateContent(String id, String content, Instant updatedAt);

    void setEpic(String id, String epicId, Instant updatedAt);

    int clearEpic(String epicId, Instant updatedAt);

    void delete(String id);
}
