package com.monitoring.customgraph.domain;

public class DomainModels {
    public record GraphDefinition(int id,
                                  String name,
                                  String description,
                                  String ownerUserId,
                                  int groupId,
                                  boolean isPrivate) {}

    public record GraphSource(int id, int graphId, int moduleId, double weight) {}
}
