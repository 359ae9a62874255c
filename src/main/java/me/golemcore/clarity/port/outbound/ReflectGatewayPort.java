package me.golemcore.clarity.port.outbound;

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

import me.golemcore.clarity.domain.model.ReflectRequest;
import me.golemcore.clarity.domain.model.ReflectResponse;
import me.golemcore.clarity.domain.model.ReflectTool;
import me.golemcore.clarity.domain.model.StepsProgramme;
import me.golemcore.clarity.domain.model.StepsResponse;
import me.golemcore.clarity.domain.model.TalkRequest;
import me.golemcore.clarity.domain.model.TalkResponse;

/**
 * Port for the remote reasoning service.
 *
 * <p>
 * Calls block the caller and fail with
 * {@link me.golemcore.clarity.domain.exception.ReflectGatewayException}. The
 * port never retries; callers decide on local fallback content.
 */
public interface ReflectGatewayPort {

    ReflectResponse runTool(ReflectTool tool, ReflectRequest request);

    default ReflectResponse reflect(ReflectRequest request) {
        return runTool(ReflectTool.REFLECT, request);
    }

    default ReflectResponse options(ReflectRequest request) {
        return runTool(ReflectTool.OPTIONS, request);
    }

    default ReflectResponse questions(ReflectRequest request) {
        return runTool(ReflectTool.QUESTIONS, request);
    }

    default ReflectResponse perspective(ReflectRequest request) {
        return runTool(ReflectTool.PERSPECTIVE, request);
    }

    TalkResponse talk(TalkRequest request);

    StepsResponse steps(StepsProgramme kind, String programme);

    /**
     * Whether the gateway is enabled and configured with a base URL and key.
     */
    boolean isAvailable();
}
