package com.example.snapshotcache.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

public final class Records {

    private Records() {
    }

    public static ObjectNode record(String id, String name) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("id", id);
        node.put("name", name);
        return node;
    }

    public static ObjectNode task(String id, String status, String dueDate, String... assignees) {
        ObjectNode node = record(id, "Task " + id);
        node.put("status", status);
        node.put("dueDate", dueDate);
        ArrayNode array = node.putArray("assignees");
        for (String assignee : assignees) {
            array.add(assignee);
        }
        return node;
    }

    public static List<JsonNode> projects(int count) {
        List<JsonNode> records = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            records.add(record("project-" + i, "Project " + i));
        }
        return records;
    }
}
