package ch.so.agi.taskpilot.retrieval;

import java.util.List;

public interface RetrievalService {
    RetrievalResult retrieve(List<String> keywords);
}
