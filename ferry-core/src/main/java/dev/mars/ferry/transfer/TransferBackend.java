/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.ferry.transfer;

import dev.mars.ferry.core.exceptions.TransferException;

/**
 * Client of the remote object store. Implementations perform the actual chunked upload.
 *
 * <p>Contract:</p>
 * <ul>
 *   <li>Called only by the transfer worker, on its blocking executor, one call at a time</li>
 *   <li>Must poll {@code cancellation} between chunks, not only before starting, and return
 *       {@link TransferOutcome#cancelled()} as soon as it reports true</li>
 *   <li>Authentication failures are thrown as
 *       {@link dev.mars.ferry.core.exceptions.TransferAuthException}</li>
 *   <li>Any other failure is thrown as {@link TransferException} or returned as
 *       {@link TransferOutcome#failed(String, Throwable)}</li>
 * </ul>
 */
public interface TransferBackend {

    /**
     * Get the backend name, used in status text and logs
     */
    String getBackendName();

    /**
     * Upload the source to its destination.
     *
     * @param source       the materialized payload and its destination metadata
     * @param progress     receives fractional progress as chunks are acknowledged
     * @param cancellation polled between chunks
     * @return the outcome; a destination id when completed
     * @throws TransferException if the upload fails
     */
    TransferOutcome transfer(TransferSource source, ProgressListener progress,
                             CancellationCheck cancellation) throws TransferException;
}
