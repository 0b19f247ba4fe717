package com.motherrealm.backend.command.controller;

import com.motherrealm.backend.command.api.RealmCommandRequest;
import com.motherrealm.backend.command.service.RealmCommandResult;
import com.motherrealm.backend.command.service.RealmCommandService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/realm")
public class RealmCommandController {

  private final RealmCommandService realmCommandService;

  public RealmCommandController(RealmCommandService realmCommandService) {
    this.realmCommandService = realmCommandService;
  }

  @PostMapping("/commands")
  public RealmCommandResult execute(@RequestBody @Valid RealmCommandRequest request) {
    return realmCommandService.execute(request.sender(), request.prompt());
  }
}
