package dk.cloudcreate.imkitchen.eventstore.persistence;

import dk.cloudcreate.imkitchen.eventstore.eventstream.*;
import dk.cloudcreate.imkitchen.eventstore.types.*;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.*;
import java.time.OffsetDateTime;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

class PersistedEventRowMapper implements RowMapper<PersistedEvent> {
    private final AggregateTypeConfiguration configuration;

    PersistedEventRowMapper(AggregateTypeConfiguration configuration) {
        this.configuration = requireNonNull(configuration, "No configuration provided");
    }

    @Override
    public PersistedEvent map(ResultSet rs, StatementContext ctx) throws SQLException {
        var eventTypeValue = rs.getString("event_type");
        if (eventTypeValue == null || eventTypeValue.isBlank()) {
            throw new IllegalStateException(msg("[{}] Row with global_order {} has an empty event_type",
                                                configuration.aggregateType,
                                                rs.getLong("global_order")));
        }
        var registration = configuration.registrationFor(EventType.of(eventTypeValue));
        var metaData     = configuration.jsonSerializer.deserialize(rs.getString("event_metadata"), EventMetaData.class);
        return PersistedEvent.from(EventId.of(rs.getString("event_id")),
                                   configuration.aggregateType,
                                   rs.getString("aggregate_id"),
                                   new EventJSON(configuration.jsonSerializer,
                                                 registration.eventType,
                                                 registration.javaType,
                                                 rs.getString("event_payload")),
                                   EventOrder.of(rs.getLong("event_order")),
                                   EventRevision.of(rs.getInt("event_revision")),
                                   GlobalEventOrder.of(rs.getLong("global_order")),
                                   metaData,
                                   rs.getObject("committed_at", OffsetDateTime.class));
    }
}
