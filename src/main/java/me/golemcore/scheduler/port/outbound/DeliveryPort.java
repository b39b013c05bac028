package me.golemcore.scheduler.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.scheduler.domain.model.DeliveryReceipt;
import me.golemcore.scheduler.domain.model.DeliveryRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Port to the chat transport that posts scheduled messages. Adapters map the
 * request onto their own threading model (Matrix threads, Discord threads,
 * Telegram replies) and complete the future with the identifiers of the posted
 * message, or exceptionally with a
 * {@link me.golemcore.scheduler.domain.exception.DeliveryException}.
 */
public interface DeliveryPort {

    CompletableFuture<DeliveryReceipt> deliver(DeliveryRequest request);
}
