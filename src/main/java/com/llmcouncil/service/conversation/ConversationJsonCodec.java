package com.llmcouncil.service.conversation;

import com.llmcouncil.domain.AggregateRankingEntry;
import com.llmcouncil.domain.Conversation;
import com.llmcouncil.domain.ConversationMessage;
import com.llmcouncil.domain.CouncilOverrides;
import com.llmcouncil.domain.DeliberationMode;
import com.llmcouncil.domain.DeliberationResult;
import com.llmcouncil.domain.ErrorKind;
import com.llmcouncil.domain.ModelQueryError;
import com.llmcouncil.domain.RawRanking;
import com.llmcouncil.domain.Stage1Result;
import com.llmcouncil.domain.Stage3Result;
import com.llmcouncil.domain.TournamentRankingEntry;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * org.json mapping of a stored conversation file.
 *
 * <p>Keys are snake_case. Reading throws {@link org.json.JSONException} on a structurally
 * broken file; the store turns that into a
 * {@link com.llmcouncil.exception.ConversationStoreException}.
 */
final class ConversationJsonCodec {

    private ConversationJsonCodec() {
    }

    static JSONObject write(Conversation c) {
        JSONArray messages = new JSONArray();
        for (ConversationMessage m : c.messages()) {
            messages.put(writeMessage(m));
        }
        JSONObject json = new JSONObject()
                .put("id", c.id())
                .put("created_at", c.createdAt().toString())
                .put("title", c.title())
                .put("messages", messages);
        CouncilOverrides o = c.overrides();
        if (!CouncilOverrides.NONE.equals(o)) {
            JSONObject overrides = new JSONObject();
            if (o.councilModels() != null) {
                overrides.put("council_models", new JSONArray(o.councilModels()));
            }
            if (o.chairmanModel() != null) {
                overrides.put("chairman_model", o.chairmanModel());
            }
            if (o.webSearchEnabled() != null) {
                overrides.put("web_search_enabled", o.webSearchEnabled().booleanValue());
            }
            json.put("council_config", overrides);
        }
        return json;
    }

    static Conversation read(JSONObject json) {
        List<ConversationMessage> messages = new ArrayList<>();
        JSONArray arr = json.getJSONArray("messages");
        for (int i = 0; i < arr.length(); i++) {
            messages.add(readMessage(arr.getJSONObject(i)));
        }
        CouncilOverrides overrides = CouncilOverrides.NONE;
        JSONObject cfg = json.optJSONObject("council_config");
        if (cfg != null) {
            List<String> models = null;
            JSONArray m = cfg.optJSONArray("council_models");
            if (m != null) {
                models = new ArrayList<>();
                for (int i = 0; i < m.length(); i++) {
                    models.add(m.getString(i));
                }
            }
            String chairman = cfg.has("chairman_model") ? cfg.getString("chairman_model") : null;
            Boolean web = cfg.has("web_search_enabled") ? cfg.getBoolean("web_search_enabled") : null;
            overrides = new CouncilOverrides(models, chairman, web);
        }
        return new Conversation(
                json.getString("id"),
                Instant.parse(json.getString("created_at")),
                json.optString("title", Conversation.DEFAULT_TITLE),
                messages,
                overrides);
    }

    private static JSONObject writeMessage(ConversationMessage m) {
        JSONObject json = new JSONObject().put("role", m.role());
        if (m.isUser()) {
            return json.put("content", m.content());
        }
        DeliberationResult d = m.deliberation();
        if (d == null) {
            return json.put("content", m.content() == null ? JSONObject.NULL : m.content());
        }
        json.put("mode", d.mode().wireName())
                .put("stage1", list(d.stage1(), r -> new JSONObject()
                        .put("model", r.model())
                        .put("response", r.content())))
                .put("stage2", list(d.stage2(), r -> new JSONObject()
                        .put("model", r.model())
                        .put("ranking", r.rankingText())
                        .put("parsed_ranking", new JSONArray(r.parsedRanking()))))
                .put("stage3", d.stage3() == null ? JSONObject.NULL : new JSONObject()
                        .put("model", d.stage3().model())
                        .put("response", d.stage3().response()));

        JSONObject labels = new JSONObject();
        d.labelToModel().forEach(labels::put);
        JSONObject metadata = new JSONObject()
                .put("label_order", new JSONArray(d.labelToModel().keySet()))
                .put("label_to_model", labels)
                .put("aggregate_rankings", list(d.aggregateRankings(), e -> new JSONObject()
                        .put("model", e.model())
                        .put("average_rank", e.averageRank())
                        .put("rankings_count", e.rankingsCount())))
                .put("tournament_rankings", list(d.tournamentRankings(), e -> new JSONObject()
                        .put("model", e.model())
                        .put("wins", e.wins())
                        .put("losses", e.losses())
                        .put("ties", e.ties())
                        .put("score", e.score())
                        .put("pairwise_wins", e.pairwiseWins())
                        .put("rankings_count", e.rankingsCount())))
                .put("errors", new JSONObject()
                        .put("stage1", list(d.stage1Errors(), ConversationJsonCodec::writeError))
                        .put("stage2", list(d.stage2Errors(), ConversationJsonCodec::writeError))
                        .put("stage3", list(d.stage3Errors(), ConversationJsonCodec::writeError)));
        if (d.failureSummary() != null) {
            metadata.put("failure_summary", d.failureSummary());
        }
        return json.put("metadata", metadata);
    }

    private static ConversationMessage readMessage(JSONObject json) {
        String role = json.getString("role");
        if (!json.has("metadata")) {
            String content = json.isNull("content") ? null : json.optString("content", null);
            return new ConversationMessage(role, content, null);
        }
        JSONObject meta = json.getJSONObject("metadata");
        JSONObject errors = meta.getJSONObject("errors");

        Map<String, String> labelToModel = new LinkedHashMap<>();
        JSONObject labels = meta.getJSONObject("label_to_model");
        JSONArray order = meta.getJSONArray("label_order");
        for (int i = 0; i < order.length(); i++) {
            String label = order.getString(i);
            labelToModel.put(label, labels.getString(label));
        }

        Stage3Result stage3 = json.isNull("stage3") ? null : new Stage3Result(
                json.getJSONObject("stage3").getString("model"),
                json.getJSONObject("stage3").getString("response"));

        DeliberationResult d = new DeliberationResult(
                DeliberationMode.fromParam(json.optString("mode", "council")),
                readList(json.getJSONArray("stage1"), o -> new Stage1Result(o.getString("model"),
                        o.getString("response"))),
                readList(errors.getJSONArray("stage1"), ConversationJsonCodec::readError),
                readList(json.getJSONArray("stage2"), o -> new RawRanking(o.getString("model"),
                        o.getString("ranking"), strings(o.getJSONArray("parsed_ranking")))),
                readList(errors.getJSONArray("stage2"), ConversationJsonCodec::readError),
                labelToModel,
                readList(meta.getJSONArray("aggregate_rankings"), o -> new AggregateRankingEntry(
                        o.getString("model"), o.getDouble("average_rank"), o.getInt("rankings_count"))),
                readList(meta.getJSONArray("tournament_rankings"), o -> new TournamentRankingEntry(
                        o.getString("model"), o.getInt("wins"), o.getInt("losses"), o.getInt("ties"),
                        o.getInt("score"), o.getInt("pairwise_wins"), o.getInt("rankings_count"))),
                stage3,
                readList(errors.getJSONArray("stage3"), ConversationJsonCodec::readError),
                meta.optString("failure_summary", null));
        return new ConversationMessage(role, stage3 == null ? null : stage3.response(), d);
    }

    private static JSONObject writeError(ModelQueryError e) {
        JSONObject json = new JSONObject()
                .put("model", e.model())
                .put("error_type", e.kind().wireName())
                .put("message", e.message());
        if (e.statusCode() != null) {
            json.put("status_code", e.statusCode().intValue());
        }
        return json;
    }

    private static ModelQueryError readError(JSONObject o) {
        Integer status = o.has("status_code") ? o.getInt("status_code") : null;
        return new ModelQueryError(o.getString("model"), ErrorKind.fromWireName(o.optString("error_type")),
                o.optString("message"), status);
    }

    private static <T> JSONArray list(List<T> items, Function<T, JSONObject> mapper) {
        JSONArray arr = new JSONArray();
        for (T item : items) {
            arr.put(mapper.apply(item));
        }
        return arr;
    }

    private static <T> List<T> readList(JSONArray arr, Function<JSONObject, T> mapper) {
        List<T> out = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            out.add(mapper.apply(arr.getJSONObject(i)));
        }
        return out;
    }

    private static List<String> strings(JSONArray arr) {
        List<String> out = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            out.add(arr.getString(i));
        }
        return out;
    }
}
