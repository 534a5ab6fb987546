package com.llmcouncil.service.conversation;

import com.llmcouncil.config.properties.CouncilProperties;
import com.llmcouncil.domain.Conversation;
import com.llmcouncil.domain.CouncilOverrides;
import com.llmcouncil.domain.CouncilSnapshot;
import com.llmcouncil.exception.InvalidMessageException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Resolves the council configuration a turn runs with.
 *
 * <p>The global {@link CouncilProperties} are layered under the conversation's own overrides
 * and frozen into a {@link CouncilSnapshot}. Callers take one snapshot per turn and pass it on;
 * nothing downstream reads configuration again.
 */
@Service
public class CouncilConfigurationService {

    private final CouncilProperties props;

    public CouncilConfigurationService(CouncilProperties props) {
        this.props = Objects.requireNonNull(props);
    }

    public CouncilSnapshot defaults() {
        return new CouncilSnapshot(props.getModels(), props.getChairmanModel(), props.isWebSearchEnabled());
    }

    public CouncilSnapshot snapshot(Conversation conversation) {
        return snapshot(conversation == null ? CouncilOverrides.NONE : conversation.overrides());
    }

    public CouncilSnapshot snapshot(CouncilOverrides overrides) {
        CouncilOverrides o = overrides == null ? CouncilOverrides.NONE : overrides;
        List<String> models = o.councilModels() != null ? o.councilModels() : props.getModels();
        String chairman = o.chairmanModel() != null ? o.chairmanModel() : props.getChairmanModel();
        boolean web = o.webSearchEnabled() != null ? o.webSearchEnabled() : props.isWebSearchEnabled();
        return new CouncilSnapshot(models, chairman, web);
    }

    /**
     * Rejects overrides that could never form a valid snapshot.
     *
     * @throws InvalidMessageException naming the offending field
     */
    public CouncilOverrides validate(CouncilOverrides overrides) {
        if (overrides == null) {
            return CouncilOverrides.NONE;
        }
        if (overrides.councilModels() != null) {
            if (overrides.councilModels().isEmpty()) {
                throw new InvalidMessageException("council_models must contain at least one model");
            }
            for (String m : overrides.councilModels()) {
                if (m == null || m.isBlank()) {
                    throw new InvalidMessageException("council_models entries must be non-empty");
                }
            }
        }
        if (overrides.chairmanModel() != null && overrides.chairmanModel().isBlank()) {
            throw new InvalidMessageException("chairman_model must be non-empty");
        }
        return overrides;
    }
}
