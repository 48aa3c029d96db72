package com.whereq.kiln.lifecycle;

import com.whereq.kiln.model.BuildPhase;
import com.whereq.kiln.scheduler.StepDefinition;

import java.util.List;
import java.util.Map;

/**
 * Maps the working phases of a build onto step DAGs
 */
public interface StepPlanner {

    /**
     * @param context the build attempt to plan
     * @return steps per phase; a phase without an entry has no work and completes immediately
     */
    Map<BuildPhase, List<StepDefinition>> plan(BuildContext context);
}
