package com.cso.dispatch.task;

/**
 * Kind-specific parameters of a {@link Task}. Implementations are bound from the task's JSON
 * parameter bag and are not modified after parsing.
 */
public interface TaskParams {

    /**
     * Checks that every field required by the task kind is present.
     *
     * @throws TaskParseException naming the first missing field
     */
    void validate() throws TaskParseException;
}
