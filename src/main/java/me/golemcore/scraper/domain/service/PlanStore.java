package me.golemcore.scraper.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.scraper.domain.exception.RegistryIOException;
import me.golemcore.scraper.domain.model.Plan;
import me.golemcore.scraper.infrastructure.config.ScraperProperties;
import me.golemcore.scraper.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Reads and writes plan files under the plans directory.
 */
@Service
@Slf4j
public class PlanStore {

    private final StoragePort storagePort;
    private final PlanCodec planCodec;
    private final String directory;

    public PlanStore(StoragePort storagePort, PlanCodec planCodec, ScraperProperties properties) {
        this.storagePort = storagePort;
        this.planCodec = planCodec;
        this.directory = properties.getPlans().getDirectory();
    }

    /**
     * Writes the plan and returns its path relative to the plans directory.
     */
    public String save(Plan plan) {
        String relativePath = plan.getRelativePath();
        try {
            storagePort.putTextAtomic(directory, relativePath, planCodec.toJson(plan), false).join();
        } catch (RuntimeException e) {
            throw new RegistryIOException("Failed to write plan file " + relativePath, e);
        }
        log.debug("[PlanRegistry] Saved plan {} to {}", plan.getName(), relativePath);
        return relativePath;
    }

    /**
     * @throws RegistryIOException
     *             if the file is missing, unreadable or not a valid plan
     */
    public Plan load(String relativePath) {
        String json;
        try {
            json = storagePort.getText(directory, relativePath).join();
        } catch (RuntimeException e) {
            throw new RegistryIOException("Failed to read plan file " + relativePath, e);
        }
        if (json == null || json.isBlank()) {
            throw new RegistryIOException("Plan file not found: " + relativePath);
        }
        try {
            return planCodec.fromJson(json);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new RegistryIOException("Corrupt plan file " + relativePath + ": " + e.getMessage(), e);
        }
    }

    public boolean exists(String relativePath) {
        return Boolean.TRUE.equals(storagePort.exists(directory, relativePath).join());
    }

    public void delete(String relativePath) {
        try {
            storagePort.deleteObject(directory, relativePath).join();
        } catch (RuntimeException e) {
            throw new RegistryIOException("Failed to delete plan file " + relativePath, e);
        }
    }
}
