package com.scorestats.platform.repository;

import com.scorestats.platform.model.Build;

import java.util.List;

public interface BuildRepository {
    List<Build> findAll();
}
