package com.llmcouncil.service.council;

import com.llmcouncil.domain.AggregateRankingEntry;
import com.llmcouncil.domain.AnonymizedResponse;
import com.llmcouncil.domain.RawRanking;
import com.llmcouncil.domain.Stage1Result;
import com.llmcouncil.domain.TournamentRankingEntry;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Prompt text for every model call the council makes.
 */
public final class PromptTemplates {

    private PromptTemplates() {
    }

    /**
     * Peer-ranking prompt. Shows only labels, never model ids.
     */
    public static String ranking(String question, List<AnonymizedResponse> responses) {
        String responsesText = responses.stream()
                .map(r -> r.displayLabel() + ":\n" + r.content())
                .collect(Collectors.joining("\n\n"));
        String first = responses.isEmpty() ? "Response A" : responses.get(0).displayLabel();

        return "You are evaluating different responses to the following question:\n\n"
                + "Question: " + question + "\n\n"
                + "Here are the responses from different models (anonymized):\n\n"
                + responsesText + "\n\n"
                + "Your task:\n"
                + "1. First, evaluate each response individually. For each response, explain what it does well "
                + "and what it does poorly.\n"
                + "2. Then, at the very end of your response, provide a final ranking.\n\n"
                + "IMPORTANT: Your final ranking MUST be formatted EXACTLY as follows:\n"
                + "- Start with the line \"" + RankingParser.MARKER + "\" (all caps, with colon)\n"
                + "- Then list the responses from best to worst as a numbered list\n"
                + "- Each line should be: number, period, space, then ONLY the response label (e.g., \"1. "
                + first + "\")\n"
                + "- Do not add any other text or explanations in the ranking section\n\n"
                + "Example of the correct format for the ranking section:\n\n"
                + RankingParser.MARKER + "\n"
                + "1. Response C\n"
                + "2. Response A\n"
                + "3. Response B\n\n"
                + "Now provide your evaluation and ranking:";
    }

    /**
     * Chairman synthesis prompt. Model identities are revealed here.
     */
    public static String chairman(String question, List<Stage1Result> stage1, List<RawRanking> stage2,
                                  List<AggregateRankingEntry> aggregate,
                                  List<TournamentRankingEntry> tournament) {
        String stage1Text = stage1.stream()
                .map(r -> "Model: " + r.model() + "\nResponse: " + r.content())
                .collect(Collectors.joining("\n\n"));
        String stage2Text = stage2.isEmpty()
                ? "(no peer rankings were received)"
                : stage2.stream()
                        .map(r -> "Model: " + r.model() + "\nRanking: " + r.rankingText())
                        .collect(Collectors.joining("\n\n"));

        StringBuilder sb = new StringBuilder();
        sb.append("You are the Chairman of an LLM Council. Multiple AI models have provided responses to a ")
                .append("user's question, and then ranked each other's responses.\n\n")
                .append("Original Question: ").append(question).append("\n\n")
                .append("STAGE 1 - Individual Responses:\n").append(stage1Text).append("\n\n")
                .append("STAGE 2 - Peer Rankings:\n").append(stage2Text).append("\n\n")
                .append("AGGREGATE RANKING (average position, lower is better):\n");
        if (aggregate.isEmpty()) {
            sb.append("(none)\n");
        }
        for (int i = 0; i < aggregate.size(); i++) {
            AggregateRankingEntry e = aggregate.get(i);
            sb.append(i + 1).append(". ").append(e.model())
                    .append(String.format(Locale.ROOT, " (average %.2f over %d rankings)\n",
                            e.averageRank(), e.rankingsCount()));
        }
        sb.append("\nTOURNAMENT RANKING (pairwise head-to-head):\n");
        if (tournament.isEmpty()) {
            sb.append("(none)\n");
        }
        for (int i = 0; i < tournament.size(); i++) {
            TournamentRankingEntry e = tournament.get(i);
            sb.append(i + 1).append(". ").append(e.model())
                    .append(" (wins ").append(e.wins())
                    .append(", losses ").append(e.losses())
                    .append(", ties ").append(e.ties()).append(")\n");
        }
        sb.append("\nYour task as Chairman is to synthesize all of this information into a single, ")
                .append("comprehensive, accurate answer to the user's original question. Consider:\n")
                .append("- The individual responses and their insights\n")
                .append("- The peer rankings and what they reveal about response quality\n")
                .append("- Any patterns of agreement or disagreement\n\n")
                .append("Provide a clear, well-reasoned final answer that represents the council's collective wisdom:");
        return sb.toString();
    }

    /**
     * System framing for chairman-direct mode, placed ahead of the conversation context.
     */
    public static String chairmanDirectSystem() {
        return "You are the Chairman of an LLM Council. For this follow-up, answer the user directly "
                + "using the conversation so far. Be accurate and concise.";
    }

    public static String summary(String conversationText) {
        return "Summarize the following conversation concisely in 2-3 sentences. Focus on key topics, "
                + "questions asked, and important context that would be needed to understand follow-up "
                + "questions.\n\n"
                + "Conversation:\n" + conversationText + "\n\n"
                + "Concise summary:";
    }

    public static String title(String question) {
        return "Generate a very short title (3-5 words maximum) that summarizes the following question.\n"
                + "The title should be concise and descriptive. Do not use quotes or punctuation in the title.\n\n"
                + "Question: " + question + "\n\n"
                + "Title:";
    }
}
