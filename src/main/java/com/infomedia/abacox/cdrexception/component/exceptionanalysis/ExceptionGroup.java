package com.infomedia.abacox.cdrexception.component.exceptionanalysis;

import com.infomedia.abacox.cdrexception.component.cdrprocessing.Call;
import lombok.Value;

import java.util.List;

/**
 * Calls sharing an {@link ExceptionGroupKey}, in the order they were processed.
 */
@Value
public class ExceptionGroup {
    ExceptionGroupKey key;
    List<Call> calls;
    Classification classification;

    public int getInstanceCount() {
        return calls.size();
    }

    public boolean isReported() {
        return classification != Classification.NONE;
    }
}
