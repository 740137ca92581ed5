package com.switchyard.core.persistence;

import com.switchyard.core.model.Epic;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

public interface EpicStore {

    void insert(Epic epic);

    void update(Epic epic);

    Optional<Epic> findById(String id);

    Optional<Epic> findByName(Path repositoryPath, String name);

    List<Epic> list(Path repositoryPath);

    void delete(String id);
}
