package com.rusttrace.adapter.ir;

import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * POJOs matching the lobster implementation-trace interchange format, version 3.
 * Field declaration order is the JSON field order.
 */
public final class LobsterModel {

    public static final String GENERATOR = "lobster-rust";
    public static final String SCHEMA = "lobster-imp-trace";
    public static final int VERSION = 3;
    public static final String LANGUAGE = "Rust";
    public static final String TAG_PREFIX = "rust ";

    private LobsterModel() {}

    public static class LobsterDocument {
        @SerializedName("data")      public List<LobsterItem> data;
        @SerializedName("generator") public String generator;
        @SerializedName("schema")    public String schema;
        @SerializedName("version")   public int version;
    }

    public static class LobsterItem {
        @SerializedName("tag")         public String tag;
        @SerializedName("name")        public String name;
        @SerializedName("location")    public LobsterLocation location;
        @SerializedName("messages")    public List<String> messages;
        @SerializedName("just_up")     public List<String> justUp;
        @SerializedName("just_down")   public List<String> justDown;
        @SerializedName("just_global") public List<String> justGlobal;
        @SerializedName("refs")        public List<String> refs;
        @SerializedName("language")    public String language;
        @SerializedName("kind")        public String kind;     // Function, Struct
    }

    public static class LobsterLocation {
        @SerializedName("kind")   public String kind;          // always "file"
        @SerializedName("file")   public String file;
        @SerializedName("line")   public Integer line;         // nullable
        @SerializedName("column") public Integer column;       // nullable
    }
}
