/*
 * Copyright 2026 Inscope Metrics
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
package com.arpnetworking.lightcurve.merge;

/**
 * Whether a merged bin is committed to the dataset it was merged from.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public enum InsertPolicy {

    /**
     * Always insert the merged bin. Its kind is forced to the kind of the
     * dataset regardless of significance, overriding any force flags.
     */
    ALWAYS_COERCE,

    /**
     * Insert the merged bin only if its classification matches the kind of the
     * dataset. A mismatch is not an error; the bin is simply returned.
     */
    INSERT_IF_MATCHES,

    /**
     * Never insert the merged bin; it is only returned.
     */
    NEVER_INSERT
}
