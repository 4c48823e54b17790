package ch.so.agi.taskpilot.retrieval;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "taskpilot.retrieval")
public class RetrievalProperties {
    private int keywordLimit = 5;
    private int twoTopicCap = 2;
    private int manyTopicCap = 1;

    public int getKeywordLimit() {
        return keywordLimit;
    }

    public void setKeywordLimit(int keywordLimit) {
        this.keywordLimit = keywordLimit;
    }

    public int getTwoTopicCap() {
        return twoTopicCap;
    }

    public void setTwoTopicCap(int twoTopicCap) {
        this.twoTopicCap = twoTopicCap;
    }

    public int getManyTopicCap() {
        return manyTopicCap;
    }

    public void setManyTopicCap(int manyTopicCap) {
        this.manyTopicCap = manyTopicCap;
    }
}
