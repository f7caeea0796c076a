// Copyright 2011 Google Inc.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//      http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.enterprise.loginflow.servlets;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.enterprise.loginflow.authncontroller.AuthnGuiceModule;
import com.google.enterprise.loginflow.authncontroller.LoginInitiator;
import com.google.enterprise.loginflow.common.FileUtil;
import com.google.enterprise.loginflow.config.ConfigModule;
import com.google.enterprise.loginflow.state.StateGuiceModule;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.servlet.GuiceServletContextListener;
import com.google.inject.servlet.ServletModule;

import java.io.File;
import java.util.Map;
import java.util.logging.Logger;

import javax.servlet.ServletContext;
import javax.servlet.ServletContextEvent;
import javax.servlet.http.HttpServlet;

/**
 * This is the top-level configuration of the login flow.  All the Guice
 * injection starts here.
 */
public class LoginFlowServletConfig extends GuiceServletContextListener {
  private static final Logger logger = Logger.getLogger(LoginFlowServletConfig.class.getName());

  private static final String CONFIG_PATH_PROPERTY = "configPath";
  private static final String DEFAULT_CONFIG_PATH = "conf/authsources.json";

  private static ServletContext servletContext = null;

  private static Injector injector = null;
  private static final Map<String, Class<? extends HttpServlet>> SERVLETS =
      ImmutableMap.<String, Class<? extends HttpServlet>>of(
          "/" + LoginInitiator.USERPASS_PATH, LoginUserPassServlet.class,
          "/" + LoginInitiator.USERPASS_ORG_PATH, LoginUserPassOrgServlet.class);

  @Override
  public void contextInitialized(ServletContextEvent servletContextEvent) {
    servletContext = servletContextEvent.getServletContext();
    FileUtil.setContextDirectory(servletContext.getRealPath("/WEB-INF"));
    super.contextInitialized(servletContextEvent);
    logger.info("Context inited " + servletContext.getRealPath("/WEB-INF"));
  }

  @Override
  protected synchronized Injector getInjector() {
    if (injector != null) {
      return injector;
    }
    injector = makeInjector(getConfigPath(), new LocalServletModule());
    return injector;
  }

  private static String getConfigPath() {
    // -DconfigPath=... wins over the web-app's context parameter.
    String path = System.getProperty(CONFIG_PATH_PROPERTY);
    if (!Strings.isNullOrEmpty(path)) {
      return path.trim();
    }
    path = (servletContext == null) ? null : servletContext.getInitParameter(CONFIG_PATH_PROPERTY);
    if (!Strings.isNullOrEmpty(path)) {
      return path.trim();
    }
    if (!new File(FileUtil.getContextDirectory(), DEFAULT_CONFIG_PATH).exists()) {
      logger.warning("No configuration at " + DEFAULT_CONFIG_PATH);
    }
    return DEFAULT_CONFIG_PATH;
  }

  @VisibleForTesting
  public static synchronized Injector makeTestingInjector(String configFile) {
    injector = makeInjector(configFile, new TestModule());
    return injector;
  }

  private static Injector makeInjector(String configFile, AbstractModule... extra) {
    ImmutableList.Builder<AbstractModule> guiceModuleBuilder = ImmutableList.builder();
    guiceModuleBuilder.add(new ConfigModule(configFile));
    guiceModuleBuilder.add(new StateGuiceModule());
    guiceModuleBuilder.add(new AuthnGuiceModule());
    for (AbstractModule module : extra) {
      guiceModuleBuilder.add(module);
    }
    return Guice.createInjector(guiceModuleBuilder.build());
  }

  private static final class LocalServletModule extends ServletModule {

    @Override
    protected void configureServlets() {
      for (Map.Entry<String, Class<? extends HttpServlet>> entry : SERVLETS.entrySet()) {
        serve(entry.getKey()).with(entry.getValue());
      }
    }
  }

  private static final class TestModule extends AbstractModule {

    @Override
    protected void configure() {
      for (Class<? extends HttpServlet> clazz : SERVLETS.values()) {
        bind(clazz);
      }
    }
  }
}
