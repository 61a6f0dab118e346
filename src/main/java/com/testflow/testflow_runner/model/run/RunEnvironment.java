package com.testflow.testflow_runner.model.run;

import com.testflow.testflow_runner.control.RunState;
import com.testflow.testflow_runner.result.ArtifactStore;

/** Collaborators shared by a run and every sub-workflow it starts. */
public record RunEnvironment(String runId,
                             RunState runState,
                             ArtifactStore artifacts,
                             RunLog runLog,
                             boolean debug) {
}
