package io.github.riemr.roster.optimization.entity;

import lombok.Value;

/**
 * 従業員ごとの開始ポイント（スケール済み）。割当ゼロの従業員も公平性の評価に含めるための問題ファクト。
 */
@Value
public class PointBaseline {
    String employeeName;
    long basePoints;
}
