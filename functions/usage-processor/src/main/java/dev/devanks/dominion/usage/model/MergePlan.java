package dev.devanks.dominion.usage.model;

import lombok.Value;

import java.util.List;

@Value
public class MergePlan {
    CorrectionWindow window;
    List<StatisticPoint> points;

    public boolean isEmpty() {
        return points.isEmpty();
    }
}
