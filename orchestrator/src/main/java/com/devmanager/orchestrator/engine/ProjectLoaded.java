package com.devmanager.orchestrator.engine;

import com.devmanager.orchestrator.model.EngineState;
import com.devmanager.orchestrator.model.Turn;

import java.util.List;

/** Payload of a PROJECT_LOADED event. */
public record ProjectLoaded(String projectName, String overallGoal, List<Turn> history, EngineState state) {}
