package com.autonomous.orchestrator.knowledge;

import com.autonomous.orchestrator.model.SourceRecord;

import java.util.List;

/**
 * One place knowledge can be retrieved from. "No match" is an empty list, not an error.
 */
public interface KnowledgeSource {

    String name();

    List<SourceRecord> retrieve(String query);
}
