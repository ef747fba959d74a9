package com.novelforge.controllers;

import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;

/**
 * Interface for API controllers.
 * Each controller registers its routes with the Javalin app.
 */
public interface Controller {

    void registerRoutes(Javalin app);

    /**
     * Project id from the {@code {id}} path segment.
     *
     * @throws IllegalArgumentException when the id is blank or names a path
     */
    static String projectId(Context ctx) {
        String id = ctx.pathParam("id").trim();
        if (id.isEmpty() || id.contains("/") || id.contains("\\") || id.startsWith(".")) {
            throw new IllegalArgumentException("Invalid project id: " + id);
        }
        return id;
    }

    /**
     * Error payload that never carries a null message.
     */
    static Map<String, Object> errorBody(Exception e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) {
            m = e.getClass().getSimpleName();
        }
        return Map.of("error", m);
    }
}
