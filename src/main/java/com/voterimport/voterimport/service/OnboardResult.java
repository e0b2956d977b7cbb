package com.voterimport.voterimport.service;

import com.voterimport.voterimport.config.StateConfig;
import com.voterimport.voterimport.schema.DetectionResult;

import java.nio.file.Path;

public record OnboardResult(StateConfig config, DetectionResult detection, Path configPath) {
}
