package ch.so.agi.taskpilot.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import ch.so.agi.taskpilot.catalog.CatalogProperties;
import ch.so.agi.taskpilot.intent.IntentClassifierProperties;
import ch.so.agi.taskpilot.model.GenerationProperties;
import ch.so.agi.taskpilot.prompt.PromptProperties;
import ch.so.agi.taskpilot.retrieval.RetrievalProperties;

@SpringBootApplication(scanBasePackages = "ch.so.agi.taskpilot")
@EnableConfigurationProperties({ RetrievalProperties.class, IntentClassifierProperties.class, PromptProperties.class,
        GenerationProperties.class, CatalogProperties.class })
public class TaskpilotApplication {
    public static void main(String[] args) {
        SpringApplication.run(TaskpilotApplication.class, args);
    }
}
