package ch.so.agi.taskpilot.intent;

public interface IntentClassifier {

    IntentClassification classify(String text);
}
