package com.example.expensegateway.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String ROOT = "/";
    public static final String API_BASE = "/api";
    public static final String HEALTH_BASE = "/health";

    // Enrollment paths
    public static final String AUTHORIZE = "/authorize";
    public static final String CALLBACK = "/callback";

    // Account paths
    public static final String ME = "/me";
    public static final String USERS = "/users";
    public static final String CONNECTION = "/connection";
    public static final String OVERVIEW = "/overview";
    public static final String CATEGORIES = "/categories";
    public static final String CURRENCIES = "/currencies";

    // Splitwise resources
    public static final String EXPENSES = "/expenses";
    public static final String COMMENTS = "/comments";
    public static final String GROUPS = "/groups";
    public static final String MEMBERS = "/members";
    public static final String FRIENDS = "/friends";

    // Health paths
    public static final String LIVE = "/live";
    public static final String READY = "/ready";

    private ApiPath() {}
  }

  private ApiConstants() {}
}
