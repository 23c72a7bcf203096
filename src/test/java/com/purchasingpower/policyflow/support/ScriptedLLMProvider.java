package com.purchasingpower.policyflow.support;

import com.purchasingpower.policyflow.client.LLMProvider;
import com.purchasingpower.policyflow.client.PromptMessage;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Generation provider answering from a script instead of a live model.
 *
 * Each call for a stage takes the next scripted reply for that stage; when
 * none is queued the stage's canned reply is returned. Canned replies use
 * the untidy formats real models produce, so the whole extraction chain runs.
 */
public class ScriptedLLMProvider implements LLMProvider {

    public static final String NAME = "Scripted";

    private static final Map<String, String> CANNED = Map.ofEntries(
            entry("intake", "Here is the customer:\n```json\n{\"name\": \"Jane Driver\", \"email\": \"jane@example.com\"}\n```"),
            entry("profile", "{vehicle: {make: \"Toyota\", model: \"Corolla\", year: 2019}, "
                    + "drivingHistory: {violations: 0, accidents: 0, yearsLicensed: 12}}"),
            entry("underwriting", "{\"answers\": {\"UW-LICENSE\": \"yes\", \"UW-REGISTRATION\": \"Yes\", "
                    + "\"UW-MVR-CONSENT\": \"Yes\", \"UW-RIDESHARE\": \"No\"}}"),
            entry("risk", "Risk result: {\"riskScore\": 3.5, \"riskFactors\": [\"Clean record\"]} Thanks!"),
            entry("coverage", "```\n{\"coverages\": [\"Collision\", \"Liability\"], \"limits\": {\"Collision\": 50000, "
                    + "\"liability\": 150000}, \"deductibles\": {\"collision\": 750}, \"exclusions\": [\"Racing\"], "
                    + "\"addOns\": []}\n```"),
            entry("drafting", "POLICY WORDING\nThe insurer covers collision and liability as scheduled."),
            entry("polish", "Policy wording: the insurer covers collision and liability as scheduled."),
            entry("pricing", "{\"basePremium\": 900, \"finalPremium\": 980.25}"),
            entry("quote", "Your quote is ready. Final premium $980.25."),
            entry("presentation", "Jane, your package covers collision and liability for $980.25 a year."),
            entry("approval", "Decision: {\"approved\": true, \"reasons\": [\"Within appetite\"]}"),
            entry("regulatory", "```json\n{\"compliance\": true, \"issues\": []}\n```"),
            entry("monitoring", "{\"monitoringStatus\": \"Active\", \"notes\": \"Annual review\"}"),
            entry("summary", "{summary: \"Policy issued for Jane Driver with collision and liability cover.\"}")
    );

    private final Map<String, Deque<String>> scripted = new HashMap<>();
    private final Map<String, Integer> calls = new HashMap<>();
    private final Set<String> failing = new HashSet<>();

    @Override
    public synchronized String chat(List<PromptMessage> messages, String stageName, String sessionId) {
        calls.merge(stageName, 1, Integer::sum);
        if (failing.contains(stageName)) {
            throw new IllegalStateException("Scripted outage for stage " + stageName);
        }
        Deque<String> queue = scripted.get(stageName);
        if (queue != null && !queue.isEmpty()) {
            return queue.poll();
        }
        return CANNED.getOrDefault(stageName, "no idea");
    }

    @Override
    public String getProviderName() {
        return NAME;
    }

    public synchronized ScriptedLLMProvider script(String stageName, String... replies) {
        Deque<String> queue = scripted.computeIfAbsent(stageName, k -> new ArrayDeque<>());
        queue.addAll(List.of(replies));
        return this;
    }

    public synchronized ScriptedLLMProvider failStage(String stageName) {
        failing.add(stageName);
        return this;
    }

    public synchronized int callsFor(String stageName) {
        return calls.getOrDefault(stageName, 0);
    }

    public synchronized void reset() {
        scripted.clear();
        calls.clear();
        failing.clear();
    }
}
