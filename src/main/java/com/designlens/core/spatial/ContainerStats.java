package com.designlens.core.spatial;

/**
 * Frame/group size statistics. Large means more than twice the average area,
 * small means less than half of it.
 */
public record ContainerStats(int count, double averageArea, int large, int small) {}
