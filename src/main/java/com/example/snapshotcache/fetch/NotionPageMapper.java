package com.example.snapshotcache.fetch;

import com.example.snapshotcache.model.ResourceType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Flattens Notion database pages into cache records.
 * <p>
 * Every record carries {@code id}, {@code url}, {@code createdTime}, {@code lastEditedTime},
 * {@code name}, {@code status} and {@code assignees}; dated types also carry {@code dueDate}
 * as an ISO date. The remaining fields depend on the resource type.
 */
public class NotionPageMapper {

    static final String UNASSIGNED = "Unassigned";
    static final String UNTITLED = "Untitled";

    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public ObjectNode toRecord(ResourceType type, JsonNode page) {
        JsonNode properties = page.path("properties");
        ObjectNode record = nodes.objectNode();
        record.put("id", page.path("id").asText());
        record.put("url", text(page.path("url")));
        record.put("createdTime", text(page.path("created_time")));
        record.put("lastEditedTime", text(page.path("last_edited_time")));

        switch (type) {
            case PROJECTS -> mapProject(properties, record);
            case TASKS -> mapTask(properties, record);
            case TODOS -> mapTodo(properties, record);
        }
        return record;
    }

    private void mapProject(JsonNode properties, ObjectNode record) {
        record.put("name", orDefault(plainText(properties.path("Project name").path("title")), UNTITLED));
        record.put("status", optionName(properties.path("Status").path("status")));
        JsonNode health = properties.path("Health").path("select");
        record.put("healthStatus", optionName(health));
        record.put("healthColor", text(health.path("color")));
        JsonNode priority = properties.path("Priority").path("select");
        record.put("priority", optionName(priority));
        record.put("priorityColor", text(priority.path("color")));

        Set<String> assignees = people(properties.path("Assignee"));
        if (assignees.isEmpty()) {
            assignees.add(UNASSIGNED);
        }
        record.set("assignees", toArray(assignees));
        record.put("taskCount", properties.path("Task Count").path("rollup").path("number").asInt(0));
    }

    private void mapTask(JsonNode properties, ObjectNode record) {
        record.put("name", plainText(properties.path("Task name").path("title")));
        record.put("status", optionName(properties.path("Status").path("status")));
        record.put("priority", optionName(properties.path("Priority").path("select")));
        record.put("effortLevel", optionName(properties.path("Effort level").path("select")));
        record.put("description", plainText(properties.path("Description").path("rich_text")));
        record.put("dueDate", date(properties.path("Due date")));

        ArrayNode taskTypes = record.putArray("taskTypes");
        for (JsonNode option : properties.path("Task type").path("multi_select")) {
            taskTypes.add(option.path("name").asText());
        }
        record.set("assignees", toArray(people(properties.path("Assignee"))));
    }

    private void mapTodo(JsonNode properties, ObjectNode record) {
        record.put("name", orDefault(plainText(properties.path("Name").path("title")), UNTITLED));
        record.put("status", optionName(properties.path("Status").path("status")));
        record.put("dueDate", date(properties.path("Deadline")));
        record.put("dateDone", date(properties.path("Date Done")));

        ArrayNode projectIds = record.putArray("projectIds");
        for (JsonNode relation : properties.path("Project").path("relation")) {
            projectIds.add(relation.path("id").asText());
        }
        // Kanban boards assign people through either column.
        Set<String> assignees = people(properties.path("Person"));
        assignees.addAll(people(properties.path("Assign")));
        record.set("assignees", toArray(assignees));
    }

    private Set<String> people(JsonNode property) {
        Set<String> names = new LinkedHashSet<>();
        for (JsonNode person : property.path("people")) {
            String name = text(person.path("name"));
            names.add(name != null ? name : person.path("id").asText());
        }
        return names;
    }

    private ArrayNode toArray(Set<String> values) {
        ArrayNode array = nodes.arrayNode();
        values.forEach(array::add);
        return array;
    }

    private static String plainText(JsonNode richText) {
        StringBuilder text = new StringBuilder();
        for (JsonNode fragment : richText) {
            text.append(fragment.path("plain_text").asText(""));
        }
        return text.toString();
    }

    private static String optionName(JsonNode option) {
        return text(option.path("name"));
    }

    /** Date properties may hold a date-time; only the calendar date is kept. */
    private static String date(JsonNode property) {
        String start = text(property.path("date").path("start"));
        if (start == null) {
            return null;
        }
        return start.length() > 10 ? start.substring(0, 10) : start;
    }

    private static String text(JsonNode node) {
        return node.isTextual() ? node.asText() : null;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }
}
