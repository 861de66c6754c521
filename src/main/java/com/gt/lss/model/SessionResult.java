package com.gt.lss.model;

public record SessionResult(int correct, int total, int completed, int presented) { }
