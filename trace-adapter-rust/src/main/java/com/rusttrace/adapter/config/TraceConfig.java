package com.rusttrace.adapter.config;

import com.google.gson.annotations.SerializedName;

/**
 * Deserialized form of the optional JSON configuration file passed with {@code --config}.
 * Every field is optional; getters supply the command-line defaults.
 */
public class TraceConfig {

    public static final String DEFAULT_SOURCE_DIR = "./src/";
    public static final String DEFAULT_OUTPUT = "rust.lobster";

    /** Directory holding main.rs or lib.rs. */
    @SerializedName("source_dir")
    private String sourceDir;

    @SerializedName("output")
    private String output;

    /** Start from lib.rs instead of main.rs. */
    @SerializedName("lib")
    private Boolean lib;

    @SerializedName("only_tagged_functions")
    private Boolean onlyTaggedFunctions;

    public String getSourceDir()           { return sourceDir != null ? sourceDir : DEFAULT_SOURCE_DIR; }
    public String getOutput()              { return output != null ? output : DEFAULT_OUTPUT; }
    public boolean isLib()                 { return lib != null && lib; }
    public boolean isOnlyTaggedFunctions() { return onlyTaggedFunctions != null && onlyTaggedFunctions; }
}
