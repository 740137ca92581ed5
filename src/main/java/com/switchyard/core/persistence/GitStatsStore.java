package com.switchyard.core.persistence;

import com.switchyard.core.model.GitStats;

import java.util.Optional;

public interface GitStatsStore {

    Optional<GitStats> find(String sessionId);

    void save(GitStats stats);

    void delete(String sessionId);
}
