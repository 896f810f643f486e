package com.storyforge.orchestrator.api.dto;

import com.storyforge.orchestrator.model.Project;
import com.storyforge.orchestrator.model.Stage;

import java.util.List;

/** Response body for POST /projects: the project and its freshly created stages. */
public record ProjectDetailResponse(ProjectResponse project, List<StageResponse> stages) {

    public static ProjectDetailResponse from(Project project, List<Stage> stages) {
        return new ProjectDetailResponse(ProjectResponse.from(project),
                stages.stream().map(StageResponse::from).toList());
    }
}
