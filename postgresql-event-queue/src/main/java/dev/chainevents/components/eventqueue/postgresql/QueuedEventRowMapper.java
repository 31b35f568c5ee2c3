package dev.chainevents.components.eventqueue.postgresql;

import dev.chainevents.components.eventqueue.*;
import dev.chainevents.components.eventqueue.serializer.json.JSONSerializer;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

class QueuedEventRowMapper implements RowMapper<QueuedEvent> {
    private final JSONSerializer jsonSerializer;

    QueuedEventRowMapper(JSONSerializer jsonSerializer) {
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
    }

    @Override
    public QueuedEvent map(ResultSet rs, StatementContext ctx) throws SQLException {
        return new QueuedEvent(EventId.of(rs.getLong("id")),
                               EventType.of(rs.getString("event_type")),
                               new EventData(rs.getString("event_data"), jsonSerializer),
                               rs.getBoolean("is_processed"));
    }
}
