package dumb.unity;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonSubTypes.Type;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.unity.util.Json;

@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.EXISTING_PROPERTY,
        property = "eventType",
        visible = true)
@JsonSubTypes({
        @Type(value = Events.LogMessageEvent.class, name = "LogMessageEvent"),
        @Type(value = Pipeline.AttemptRejectedEvent.class, name = "AttemptRejectedEvent"),
        @Type(value = Pipeline.ExpressionAcceptedEvent.class, name = "ExpressionAcceptedEvent"),
        @Type(value = Pipeline.FallbackServedEvent.class, name = "FallbackServedEvent"),
        @Type(value = Pipeline.PipelineExhaustedEvent.class, name = "PipelineExhaustedEvent")
})
public interface UnityEvent {

    default JsonNode toJson() {
        return Json.node(this);
    }

    String getEventType();
}
