package com.neorag.service.workflow;

import com.neorag.model.SearchType;

/**
 * Decides which retrieval path answers a question.
 */
public interface RouteClassifier {

    SearchType classify(String question);
}
