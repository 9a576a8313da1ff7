package dev.devanks.voltedge.pipeline.service.check;

import dev.devanks.voltedge.pipeline.model.CheckResult;
import dev.devanks.voltedge.pipeline.model.HourlyRecord;

import java.util.List;

/**
 * A named rule over the hourly table. Implementations never modify the table.
 */
public interface QualityCheck {

    String name();

    CheckResult evaluate(List<HourlyRecord> hourly);
}
