package com.gt.lss.model;

public record PrerequisiteEdge(String parentId, String childId) { }
