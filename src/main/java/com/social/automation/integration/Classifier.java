package com.social.automation.integration;

public interface Classifier {

    Classification classify(String text);
}
