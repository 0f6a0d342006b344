package com.creditsim.simulator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

public record IntensityRequest(@JsonProperty("intensityPercent") int intensityPercent) {}
