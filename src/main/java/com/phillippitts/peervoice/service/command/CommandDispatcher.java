package com.phillippitts.peervoice.service.command;

import com.phillippitts.peervoice.domain.CommandResult;
import com.phillippitts.peervoice.domain.Intent;

/**
 * Executes a confirmed intent.
 */
public interface CommandDispatcher {

    /**
     * @throws com.phillippitts.peervoice.exception.CommandDispatchException when the command fails
     */
    CommandResult dispatch(Intent intent);
}
