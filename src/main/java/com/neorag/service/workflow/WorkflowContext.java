package com.neorag.service.workflow;

import com.neorag.model.ChunkResult;
import com.neorag.model.SearchType;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state carried through one workflow run. Not shared between requests.
 */
@Data
public class WorkflowContext {

    private final String question;
    private final float[] embedding;
    private final int topK;

    private WorkflowState state = WorkflowState.ROUTE;
    private SearchType searchType;
    private final List<ChunkResult> context = new ArrayList<>();
    private String answer;
    private final List<String> steps = new ArrayList<>();

    public void addStep(String step) {
        steps.add(step);
    }
}
