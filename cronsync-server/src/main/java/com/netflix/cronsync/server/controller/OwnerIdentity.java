/*
 * Copyright 2026 Netflix, Inc.
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

package com.netflix.cronsync.server.controller;

import java.util.Objects;

import com.netflix.cronsync.common.util.CollectionsExt;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.batch.v1.CronJob;

/**
 * The (kind, name, uid) triple identifying an owner. A recreated object with the same name has a different uid,
 * and therefore a different identity.
 */
public final class OwnerIdentity {

    static final String CRON_JOB_KIND = "CronJob";

    private final String kind;
    private final String name;
    private final String uid;

    public OwnerIdentity(String kind, String name, String uid) {
        this.kind = kind;
        this.name = name;
        this.uid = uid;
    }

    public static OwnerIdentity of(CronJob cronJob) {
        return new OwnerIdentity(CRON_JOB_KIND, cronJob.getMetadata().getName(), cronJob.getMetadata().getUid());
    }

    public static OwnerIdentity from(OwnerReference ownerReference) {
        return new OwnerIdentity(ownerReference.getKind(), ownerReference.getName(), ownerReference.getUid());
    }

    public boolean owns(HasMetadata object) {
        if (object.getMetadata() == null) {
            return false;
        }
        return CollectionsExt.nonNull(object.getMetadata().getOwnerReferences()).stream()
                .map(OwnerIdentity::from)
                .anyMatch(this::equals);
    }

    public String getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public String getUid() {
        return uid;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        OwnerIdentity that = (OwnerIdentity) o;
        return Objects.equals(kind, that.kind) &&
                Objects.equals(name, that.name) &&
                Objects.equals(uid, that.uid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, uid);
    }

    @Override
    public String toString() {
        return "OwnerIdentity{" +
                "kind='" + kind + '\'' +
                ", name='" + name + '\'' +
                ", uid='" + uid + '\'' +
                '}';
    }
}
