package com.baykanat.socialsync.domain.mapper;

import com.baykanat.socialsync.api.dto.DeadLetterView;
import com.baykanat.socialsync.api.dto.RepostResponse;
import com.baykanat.socialsync.domain.error.ErrorCategory;
import com.baykanat.socialsync.domain.model.ActionType;
import com.baykanat.socialsync.domain.model.DeliveryOutcome;
import com.baykanat.socialsync.domain.model.QueueRow;
import com.baykanat.socialsync.domain.model.QueueStatus;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.List;

/** Kuyruk domain modelleri → API görünümleri. Enum'lar wire değerleriyle yazılır. */
@Mapper(componentModel = "spring", imports = QueueStatus.class)
public interface QueueRowMapper {

    DeadLetterView toDeadLetterView(QueueRow row);

    List<DeadLetterView> toDeadLetterViews(List<QueueRow> rows);

    @Mapping(target = "success", expression = "java(outcome.getStatus() != QueueStatus.DLQ)")
    RepostResponse toRepostResponse(DeliveryOutcome outcome);

    default String actionTypeToWire(ActionType actionType) {
        return actionType != null ? actionType.wireValue() : null;
    }

    default String statusToWire(QueueStatus status) {
        return status != null ? status.wireValue() : null;
    }

    default String categoryToWire(ErrorCategory category) {
        return category != null ? category.wireValue() : null;
    }
}
