package com.patcharbiter.selector.tool.impl;

import com.patcharbiter.selector.tool.SandboxTool;
import com.patcharbiter.selector.tool.ToolManifest;
import com.patcharbiter.selector.tool.ToolPolicy;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/** Views, creates and edits files by exact string replacement. */
@Component
public class StrReplaceEditTool implements SandboxTool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "str_replace_based_edit_tool",
            "1.0.0",
            """
            Custom editing tool for viewing, creating and editing files.
            * State is persistent across command calls and discussions with the user.
            * If path is a file, view displays the result of applying cat -n. If path is a directory, view lists non-hidden files and directories up to 2 levels deep.
            * The create command cannot be used if the specified path already exists as a file.
            * The undo_edit command will revert the last edit made to the file at path.
            * The old_str parameter should match EXACTLY one or more consecutive lines from the original file.
            * If old_str is not unique in the file, the replacement will not be performed.""",
            "execute_str_replace_editor.py",
            Map.of(
                    "type", "object",
                    "properties", Map.of(
                            "command", Map.of(
                                    "type", "string",
                                    "enum", List.of("view", "create", "str_replace", "insert", "undo_edit"),
                                    "description", "The command to run."),
                            "path", Map.of(
                                    "type", "string",
                                    "description", "Absolute path to file or directory."),
                            "file_text", Map.of(
                                    "type", "string",
                                    "description", "Content of the file to be created. Required for create."),
                            "old_str", Map.of(
                                    "type", "string",
                                    "description", "String in path to replace. Required for str_replace."),
                            "new_str", Map.of(
                                    "type", "string",
                                    "description", "Replacement for old_str, or the text to insert for insert."),
                            "insert_line", Map.of(
                                    "type", "integer",
                                    "description", "new_str is inserted AFTER this line of path. Required for insert."),
                            "view_range", Map.of(
                                    "type", "array",
                                    "items", Map.of("type", "integer"),
                                    "description", "Line range to show for view, e.g. [11, 12]; [start, -1] shows to the end.")),
                    "required", List.of("command", "path")));

    private static final ToolPolicy POLICY = new ToolPolicy(60);

    @Override
    public ToolManifest manifest() {
        return MANIFEST;
    }

    @Override
    public ToolPolicy policy() {
        return POLICY;
    }
}
