package com.openforge.parley.nlu;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Labelled example utterances per category, consulted by the semantic stage
 * of {@link IntentClassifier} when no pattern is confident enough.
 * Iteration order is the tie-break order.
 */
public final class ExampleBank {

    private final Map<IntentCategory, List<String>> examples;

    public ExampleBank(Map<IntentCategory, List<String>> examples) {
        Map<IntentCategory, List<String>> copy = new LinkedHashMap<>();
        examples.forEach((category, list) -> copy.put(category, List.copyOf(list)));
        this.examples = Collections.unmodifiableMap(copy);
    }

    public Map<IntentCategory, List<String>> examples() {
        return examples;
    }

    public int size() {
        return examples.values().stream().mapToInt(List::size).sum();
    }

    public static ExampleBank defaults() {
        Map<IntentCategory, List<String>> bank = new LinkedHashMap<>();
        bank.put(IntentCategory.COMMAND, List.of(
                "open chrome browser", "launch visual studio code", "close all windows",
                "start spotify", "turn off the lights", "set volume to 50", "take screenshot",
                "open file explorer", "switch to dark mode", "restart computer",
                "git clone repository", "npm install dependencies", "run gradle build"));
        bank.put(IntentCategory.QUESTION, List.of(
                "what is machine learning", "how does forge modding work", "explain python decorators",
                "why is my mod not loading", "who invented the telephone", "where is paris",
                "how tall is mount everest", "what is the capital of france",
                "tell me about quantum physics", "why is the sky blue"));
        bank.put(IntentCategory.MATH, List.of(
                "calculate 15 times 27", "what is the derivative of x squared",
                "solve for x in 2x plus 5 equals 15", "what is 20 percent of 150",
                "divide 144 by 12", "what is the square root of 64",
                "convert 100 fahrenheit to celsius", "find the factorial of 5",
                "compute the average of 10 20 30"));
        bank.put(IntentCategory.CODE, List.of(
                "write a python function to sort list", "debug this minecraft mod code",
                "create a forge event handler", "implement binary search algorithm",
                "how to reverse a string in javascript", "fix the syntax error",
                "write unit tests", "refactor this code", "create a rest api", "write sql query"));
        bank.put(IntentCategory.FETCH, List.of(
                "search for forge documentation", "find minecraft modding tutorials",
                "get latest python news", "look up java streams api", "find restaurants nearby",
                "get weather forecast", "fetch stock prices", "search wikipedia",
                "find articles about", "get sports scores"));
        bank.put(IntentCategory.CONVERSATIONAL, List.of(
                "hello jarvis", "thank you for your help", "that's perfect", "goodbye",
                "hello", "how are you", "hi there", "good morning", "see you later",
                "nice to meet you", "you're welcome", "no problem"));
        return new ExampleBank(bank);
    }
}
