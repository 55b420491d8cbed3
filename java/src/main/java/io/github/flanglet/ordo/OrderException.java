/*
Copyright 2011-2025 Frederic Langlet
Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
you may obtain a copy of the License at

                http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package io.github.flanglet.ordo;

/**
 * This class represents failures of the ordering and selection routines. It
 * carries an error code identifying the condition.
 */
public class OrderException extends RuntimeException {

    private static final long serialVersionUID = -3306282367618433213L;

    /**
     * Error code for invalid arguments (null array, index out of range, empty range).
     */
    public static final int INVALID_ARGUMENT = 1;

    /**
     * Error code for an access to an empty priority queue.
     */
    public static final int EMPTY_QUEUE = 2;

    private final int code;

    /**
     * Constructs an {@code OrderException} with the specified detail message and
     * error code.
     *
     * @param message
     *            the detail message
     * @param code
     *            the error code
     */
    public OrderException(String message, int code) {
        super(message);
        this.code = code;
    }

    /**
     * Returns the error code of this exception.
     *
     * @return the error code
     */
    public int getErrorCode() {
        return this.code;
    }
}
