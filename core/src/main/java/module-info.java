/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

module cachet.http {
    requires transitive java.net.http;

    requires static org.jspecify;

    exports cachet.http;
    exports cachet.http.storage;
}
