package com.homework.core.service;

import com.homework.core.model.PipelineResult;

import java.nio.file.Path;

/**
 * Folder layout of the homework inbox: incoming files at the top level, files
 * being worked on in the processing folder, finished files and their result
 * documents in the results folder.
 */
public interface ResultStorageService {

    /**
     * Create the inbox, processing and results folders if they are missing.
     */
    void initializeFolders();

    /**
     * Move an incoming file into the processing folder and return its new path.
     */
    Path moveToProcessing(Path file);

    /**
     * Move a processed file into the results folder, adding a timestamp suffix
     * when a file of that name is already there.
     */
    Path moveToResults(Path file);

    /**
     * Write {@code <stem>_result.json} for the given source file name.
     */
    Path saveResult(String sourceFileName, PipelineResult result);
}
