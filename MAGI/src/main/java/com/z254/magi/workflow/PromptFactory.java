package com.z254.magi.workflow;

import com.z254.magi.context.AssembledContext;
import com.z254.magi.domain.model.Agent;
import com.z254.magi.domain.model.Message;
import com.z254.magi.llm.LLMRequest;
import com.z254.magi.tool.builtin.HttpRelayTool;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the conversations sent to agents at each step.
 */
@Component
public class PromptFactory {

    public List<LLMRequest.Message> proposal(Agent agent, String question, AssembledContext context) {
        List<String> sections = new ArrayList<>();
        sections.add(String.format("""
                You are %s, one of three independent MAGI reviewers auditing a web application.
                Answer the user's question with a concrete, evidence-based assessment. Point to specific \
                files, endpoints or behaviours when you can, and say plainly when something cannot be verified.""",
                agent.getName()));
        if (context.hasArtifact()) {
            sections.add("Repository context (uploaded code, ranked excerpts):\n" + context.getArtifactText());
        }
        if (context.hasLive()) {
            sections.add("Live site context (snapshot of the running site):\n" + context.getLiveText());
        }
        sections.add(String.format("""
                Tool usage: you may call the `%s` tool to send HTTP requests to the live site when a \
                claim needs checking. At most five requests are allowed, only public http(s) hosts on the \
                default ports are reachable, and responses are truncated. Use the results as evidence, \
                then give your final answer as plain text.""", HttpRelayTool.TOOL_NAME));
        return List.of(
                LLMRequest.systemMessage(String.join("\n\n", sections)),
                LLMRequest.userMessage(question));
    }

    public List<LLMRequest.Message> vote(Agent agent, String question, Message proposal) {
        return List.of(
                LLMRequest.systemMessage(String.format(
                        "You are %s. Evaluate the quality, clarity, and factuality of the proposal. "
                                + "Reply ONLY with a JSON object: {\"score\": 0-100, \"reason\": \"short rationale\"}.",
                        agent.getName())),
                LLMRequest.userMessage(String.format("Question:\n%s\n\nProposal:\n\n%s\n\nScore it.",
                        question, proposal.getContent())));
    }
}
